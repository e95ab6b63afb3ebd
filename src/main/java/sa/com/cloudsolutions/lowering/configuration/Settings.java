package sa.com.cloudsolutions.lowering.configuration;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import sa.com.cloudsolutions.lowering.exception.InstrumentationException;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages the configuration properties from the instrumentation.yml file.
 */
public class Settings {
    public static final String CONFIG_FILE = "instrumentation.yml";
    public static final String POLICIES = "instrumentation.policies";
    public static final String COVERAGE_PAYLOAD = "instrumentation.coverage_payload";
    public static final String SEQUENCE_POINT_TYPE = "instrumentation.sequence_point_type";
    private static final String VARIABLES = "variables";

    /**
     * HashMap to store the configurations.
     */
    protected static HashMap<String, Object> props;

    /**
     * Private constructor to prevent class being initialized.
     */
    private Settings() {}

    /**
     * Load the configuration from the instrumentation.yml file on the classpath.
     * @throws IOException if the file could not be read.
     */
    public static void loadConfigMap() throws IOException {
        if (props == null) {
            try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
                if (in == null) {
                    throw new FileNotFoundException(CONFIG_FILE);
                }
                props = new HashMap<>();
                loadYamlConfig(mapper().readValue(in, new TypeReference<Map<String, Object>>() {}));
            }
        }
    }

    public static void loadConfigMap(File f) throws IOException {
        props = new HashMap<>();
        loadYamlConfig(mapper().readValue(f, new TypeReference<Map<String, Object>>() {}));
    }

    private static ObjectMapper mapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new SimpleModule().addDeserializer(Map.class, new LinkedHashMapDeserializer()));
        return mapper;
    }

    /**
     * Load the configuration that was read from a yaml document.
     *
     * The optional top level {@code variables} section defines values that can be referred to
     * elsewhere as ${name}. Environment variables are referred to the same way.
     * @param yamlProps the parsed document
     */
    @SuppressWarnings("unchecked")
    private static void loadYamlConfig(Map<String, Object> yamlProps) {
        Map<String, Object> variables = (Map<String, Object>) yamlProps.getOrDefault(VARIABLES, new HashMap<>());
        if (variables == null) {
            variables = new HashMap<>();
        }
        variables.replaceAll((k, value) -> replaceEnvVariables(String.valueOf(value)));
        props.put(VARIABLES, variables);

        replaceVariables(yamlProps, props);
    }

    /**
     * Replace variables from the yaml file with environment or internal variables
     *
     * @param source the source from which we will copy the data
     * @param target the destination where we will put the data
     */
    @SuppressWarnings("unchecked")
    private static void replaceVariables(Map<String, Object> source, Map<String, Object> target) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value != null && !key.equals(VARIABLES)) {
                if (value instanceof Map) {
                    Map<String, Object> nestedMap = new HashMap<>();
                    replaceVariables((Map<String, Object>) value, nestedMap);
                    target.put(key, nestedMap);
                } else if (value instanceof List<?> list) {
                    List<String> result = new ArrayList<>();
                    for (Object o : list) {
                        result.add(replaceEnvVariables(replaceYamlVariables(String.valueOf(o))));
                    }
                    target.put(key, result);
                }
                else if (value instanceof String v) {
                    target.put(key, replaceEnvVariables(replaceYamlVariables(v)));
                }
                else {
                    target.put(key, value);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static String replaceYamlVariables(String value) {
        Map<String, Object> variablesMap = (Map<String, Object>) props.get(VARIABLES);
        for (Map.Entry<String, Object> variable : variablesMap.entrySet()) {
            String key = "${" + variable.getKey() + "}";
            value = value.replace(key, String.valueOf(variable.getValue()));
        }
        return value;
    }

    /**
     * The value is checked for an environment variable and replaced if found.
     * The format is ${ENV_VAR_NAME}. Unknown variables are replaced with an empty string.
     *
     * @param value the configuration that needs to be searched for env variables
     * @return the value with the env variables replaced
     */
    private static String replaceEnvVariables(String value) {
        int startIndex;
        while ((startIndex = value.indexOf("${")) != -1) {
            int endIndex = value.indexOf("}", startIndex);
            if (endIndex == -1) {
                break;
            }
            String envVar = value.substring(startIndex + 2, endIndex);
            String envValue = System.getenv(envVar);
            if (envValue != null) {
                value = value.substring(0, startIndex) + envValue + value.substring(endIndex + 1);
            } else {
                value = value.substring(0, startIndex) + value.substring(endIndex + 1);
            }
        }
        return value;
    }

    /**
     * Get the property value for the given key.
     * The cls parameter is used to cast the result to the given class so that the callers
     * need not clutter their call with casts
     *
     * @param key the key to search for
     * @param cls try to map the result to this class
     * @return an optional with the result if it's found
     */
    public static <T> Optional<T> getProperty(String key, Class<T> cls) {
        Object property = getProperty(key);
        if(property != null) {
            return Optional.of(cls.cast(property));
        }

        return Optional.empty();
    }

    public static Object getProperty(String key) {
        if (props == null) {
            return null;
        }
        Object property = props.get(key);
        if(property != null) {
            return property;
        }
        String[] parts = key.split("\\.");
        if(parts.length > 1) {
            Object result = props.get(parts[0]);
            if (result instanceof Map<?,?> map) {
                return map.get(parts[1]);
            }
        }
        return null;
    }

    public static boolean isLoaded() {
        return props != null;
    }

    /**
     * The instrumentation policies to chain, innermost first.
     * @throws InstrumentationException if the policies are not given as a list
     */
    @SuppressWarnings("unchecked")
    public static List<String> getPolicies() {
        try {
            return getProperty(POLICIES, List.class).orElse(List.of());
        } catch (ClassCastException e) {
            throw new InstrumentationException(POLICIES + " must be a list", e);
        }
    }

    public static String getCoveragePayload() {
        return getProperty(COVERAGE_PAYLOAD, String.class).orElse("$coverage");
    }

    public static String getSequencePointType() {
        return getProperty(SEQUENCE_POINT_TYPE, String.class).orElse("$SequencePoint");
    }

    public static class LinkedHashMapDeserializer extends JsonDeserializer<Map<String, Object>> {
        @Override
        @SuppressWarnings("unchecked")
        public Map<String, Object> deserialize(JsonParser p, DeserializationContext ctxt)
                throws IOException {
            return p.readValueAs(LinkedHashMap.class);
        }
    }
}
