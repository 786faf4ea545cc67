package com.openforge.netagent.config;

import com.openforge.netagent.adapter.AdapterType;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Per-tool settings, bound from {@code agent.tools.<name>}.
 *
 * agent:
 *   tools:
 *     netbox:
 *       type: netbox
 *       enabled: true
 *       aliases: [nx, nbox]
 *       base-url: https://netbox.example.com
 *       api-token: ${NETBOX_TOKEN}
 *       timeout-seconds: 30
 *       mappings-file: classpath:mappings/netbox.yml
 *
 * {@code timeoutSeconds} may be null, in which case the global
 * {@code agent.settings.timeout-seconds} applies. {@code settings} carries
 * adapter-specific extras such as LibreNMS' {@code alert-severity-mapping}.
 */
@Builder(toBuilder = true)
public record ToolProperties(
        AdapterType type,
        Boolean enabled,
        List<String> aliases,
        String baseUrl,
        String apiToken,
        Integer timeoutSeconds,
        String mappingsFile,
        Map<String, Object> settings
) {

    public ToolProperties {
        if (enabled == null)  enabled  = Boolean.TRUE;
        aliases  = aliases  == null ? List.of() : List.copyOf(aliases);
        settings = settings == null ? Map.of()  : Map.copyOf(settings);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** True when both the base URL and the API token are present. */
    public boolean hasCredentials() {
        return baseUrl != null && !baseUrl.isBlank() && apiToken != null && !apiToken.isBlank();
    }
}
