package com.tunechat.match.lexicon;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "match.lexicon")
public class LexiconProperties {
    private String resource = "classpath:lexicon/phrases.json";
    private boolean strict = false;

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }

    public boolean isStrict() {
        return strict;
    }

    public void setStrict(boolean strict) {
        this.strict = strict;
    }
}
