package com.tunechat.match.catalog;

public enum CatalogMode {
    JDBC,
    MEMORY
}
