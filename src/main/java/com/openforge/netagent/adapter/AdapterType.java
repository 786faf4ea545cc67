package com.openforge.netagent.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.http.HttpClient;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * The supported backend variants. Selecting a variant selects its adapter
 * implementation and default mapping file; nothing is discovered at runtime.
 */
public enum AdapterType {

    NETBOX("classpath:mappings/netbox.yml") {
        @Override
        public AdapterFactory factory(HttpClient httpClient, ObjectMapper objectMapper) {
            return (name, config) -> new NetboxAdapter(name, config,
                    new RestBackendClient(httpClient, objectMapper, name, config,
                            RestBackendClient.AuthStyle.TOKEN));
        }
    },

    LIBRENMS("classpath:mappings/librenms.yml") {
        @Override
        public AdapterFactory factory(HttpClient httpClient, ObjectMapper objectMapper) {
            return (name, config) -> new LibreNmsAdapter(name, config,
                    new RestBackendClient(httpClient, objectMapper, name, config,
                            RestBackendClient.AuthStyle.X_AUTH_TOKEN));
        }
    };

    private final String defaultMappingsFile;

    AdapterType(String defaultMappingsFile) {
        this.defaultMappingsFile = defaultMappingsFile;
    }

    public abstract AdapterFactory factory(HttpClient httpClient, ObjectMapper objectMapper);

    public String defaultMappingsFile() {
        return defaultMappingsFile;
    }

    /** Derives the variant from a conventional tool name ("netbox", "librenms"). */
    public static Optional<AdapterType> fromToolName(String toolName) {
        if (toolName == null) return Optional.empty();
        String normalized = toolName.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        return Arrays.stream(values())
                .filter(type -> type.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
