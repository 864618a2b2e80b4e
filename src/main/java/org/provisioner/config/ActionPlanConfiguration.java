package org.provisioner.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.provisioner.util.Env;

import java.io.IOException;
import java.util.Map;

/**
 * Settings which govern how action plans are built, translated and executed. Represented in JSON as e.g.:
 *
 * <pre>
 * {
 *   "fail_on_precedence_cycle": false,
 *   "stop_on_error": true,
 *   "node_value_prefix": "nv",
 *   "action_id_prefix": "action-id"
 * }
 * </pre>
 *
 * Missing properties take their defaults.
 */
public class ActionPlanConfiguration {
    public static final String FAIL_ON_PRECEDENCE_CYCLE_ENV = "ACTION_PLAN_FAIL_ON_PRECEDENCE_CYCLE";
    public static final String STOP_ON_ERROR_ENV = "ACTION_PLAN_STOP_ON_ERROR";
    public static final String NODE_VALUE_PREFIX_ENV = "ACTION_PLAN_NODE_VALUE_PREFIX";
    public static final String ACTION_ID_PREFIX_ENV = "ACTION_PLAN_ACTION_ID_PREFIX";

    public static final String DEFAULT_NODE_VALUE_PREFIX = "nv";
    public static final String DEFAULT_ACTION_ID_PREFIX = "action-id";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    @JsonProperty("fail_on_precedence_cycle")
    private final boolean failOnPrecedenceCycle;
    @JsonProperty("stop_on_error")
    private final boolean stopOnError;
    @JsonProperty("node_value_prefix")
    private final String nodeValuePrefix;
    @JsonProperty("action_id_prefix")
    private final String actionIdPrefix;

    @JsonCreator
    public ActionPlanConfiguration(
            @JsonProperty("fail_on_precedence_cycle") Boolean failOnPrecedenceCycle,
            @JsonProperty("stop_on_error") Boolean stopOnError,
            @JsonProperty("node_value_prefix") String nodeValuePrefix,
            @JsonProperty("action_id_prefix") String actionIdPrefix) {
        this.failOnPrecedenceCycle = failOnPrecedenceCycle != null && failOnPrecedenceCycle;
        this.stopOnError = stopOnError == null || stopOnError;
        this.nodeValuePrefix = StringUtils.defaultIfBlank(nodeValuePrefix, DEFAULT_NODE_VALUE_PREFIX);
        this.actionIdPrefix = StringUtils.defaultIfBlank(actionIdPrefix, DEFAULT_ACTION_ID_PREFIX);
    }

    public static ActionPlanConfiguration defaults() {
        return new ActionPlanConfiguration(null, null, null, null);
    }

    /**
     * Parses a configuration from its JSON representation.
     *
     * @throws ConfigurationException if the JSON is malformed or contains unknown properties
     */
    public static ActionPlanConfiguration fromJson(String json) {
        try {
            return MAPPER.readValue(json, ActionPlanConfiguration.class);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to parse action plan configuration: " + json, e);
        }
    }

    /**
     * Returns a copy of this configuration with any settings present in the process environment applied on top.
     */
    public ActionPlanConfiguration withEnvironmentOverrides() {
        return withOverrides(System.getenv());
    }

    /**
     * Returns a copy of this configuration with any settings present in {@code env} applied on top.
     *
     * @throws ConfigurationException if a boolean setting has a non-boolean value
     */
    public ActionPlanConfiguration withOverrides(Map<String, String> env) {
        try {
            return new ActionPlanConfiguration(
                    Env.getBoolean(env, FAIL_ON_PRECEDENCE_CYCLE_ENV, failOnPrecedenceCycle),
                    Env.getBoolean(env, STOP_ON_ERROR_ENV, stopOnError),
                    Env.getString(env, NODE_VALUE_PREFIX_ENV, nodeValuePrefix),
                    Env.getString(env, ACTION_ID_PREFIX_ENV, actionIdPrefix));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    public String toJsonString() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (IOException e) {
            throw new ConfigurationException("Unable to serialize action plan configuration", e);
        }
    }

    public boolean isFailOnPrecedenceCycle() {
        return failOnPrecedenceCycle;
    }

    public boolean isStopOnError() {
        return stopOnError;
    }

    public String getNodeValuePrefix() {
        return nodeValuePrefix;
    }

    public String getActionIdPrefix() {
        return actionIdPrefix;
    }

    @Override
    public boolean equals(Object o) {
        return EqualsBuilder.reflectionEquals(this, o);
    }

    @Override
    public int hashCode() {
        return HashCodeBuilder.reflectionHashCode(this);
    }

    @Override
    public String toString() {
        return ToStringBuilder.reflectionToString(this);
    }
}
