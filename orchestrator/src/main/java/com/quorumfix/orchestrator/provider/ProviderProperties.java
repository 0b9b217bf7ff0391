package com.quorumfix.orchestrator.provider;

import com.quorumfix.orchestrator.llm.WireFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Binding for {@code quorumfix.providers.*}.
 *
 * <pre>
 * quorumfix:
 *   providers:
 *     gpt4:
 *       model:       gpt-4-turbo-preview
 *       weight:      1.0
 *       timeout:     60s
 *       max-tokens:  4000
 *       endpoint:    https://api.openai.com/v1/chat/completions
 *       wire-format: OPENAI_CHAT
 *       credential:  OPENAI_API_KEY
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "quorumfix")
public class ProviderProperties {

    private Map<ProviderId, Provider> providers = new EnumMap<>(ProviderId.class);

    public Map<ProviderId, Provider> getProviders()          { return providers; }
    public void setProviders(Map<ProviderId, Provider> v)    { this.providers = v; }

    public static class Provider {
        private boolean    enabled     = true;
        private String     model;
        private double     weight      = 1.0;
        private Duration   timeout     = Duration.ofSeconds(60);
        private int        maxTokens   = 4000;
        private URI        endpoint;
        private WireFormat wireFormat  = WireFormat.OPENAI_CHAT;
        private String     credential;
        private String     steering;
        private double     temperature = 0.7;

        public boolean    isEnabled()                  { return enabled; }
        public void       setEnabled(boolean v)        { this.enabled = v; }
        public String     getModel()                   { return model; }
        public void       setModel(String v)           { this.model = v; }
        public double     getWeight()                  { return weight; }
        public void       setWeight(double v)          { this.weight = v; }
        public Duration   getTimeout()                 { return timeout; }
        public void       setTimeout(Duration v)       { this.timeout = v; }
        public int        getMaxTokens()               { return maxTokens; }
        public void       setMaxTokens(int v)          { this.maxTokens = v; }
        public URI        getEndpoint()                { return endpoint; }
        public void       setEndpoint(URI v)           { this.endpoint = v; }
        public WireFormat getWireFormat()              { return wireFormat; }
        public void       setWireFormat(WireFormat v)  { this.wireFormat = v; }
        public String     getCredential()              { return credential; }
        public void       setCredential(String v)      { this.credential = v; }
        public String     getSteering()                { return steering; }
        public void       setSteering(String v)        { this.steering = v; }
        public double     getTemperature()             { return temperature; }
        public void       setTemperature(double v)     { this.temperature = v; }

        ProviderProfile toProfile(ProviderId id) {
            return new ProviderProfile(id, model, weight, timeout, maxTokens,
                    endpoint, wireFormat, credential, steering, temperature);
        }
    }
}
