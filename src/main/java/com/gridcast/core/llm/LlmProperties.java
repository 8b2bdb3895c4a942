package com.gridcast.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gridcast.llm")
public class LlmProperties {

    private String provider = "ollama";
    private String model = "";

    /** Maximum characters of a capability result shown to the model. */
    private int maxResultChars = 2000;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxResultChars() {
        return maxResultChars;
    }

    public void setMaxResultChars(int maxResultChars) {
        this.maxResultChars = maxResultChars;
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
