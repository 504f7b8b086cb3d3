package com.tunechat.match.catalog;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "match.catalog")
public class CatalogProperties {
    private CatalogMode mode = CatalogMode.JDBC;
    private String seedResource = "classpath:catalog/seed-songs.json";
    private int efSearch = 100;

    public CatalogMode getMode() {
        return mode;
    }

    public void setMode(CatalogMode mode) {
        this.mode = mode;
    }

    public String getSeedResource() {
        return seedResource;
    }

    public void setSeedResource(String seedResource) {
        this.seedResource = seedResource;
    }

    public int getEfSearch() {
        return efSearch;
    }

    public void setEfSearch(int efSearch) {
        this.efSearch = efSearch;
    }
}
