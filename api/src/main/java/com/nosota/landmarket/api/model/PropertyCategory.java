package com.nosota.landmarket.api.model;

/**
 * Usage category of a land feature. Each category is valued in its own color resource.
 */
public enum PropertyCategory {
    RESIDENTIAL(Asset.YELLOW),
    COMMERCIAL(Asset.RED),
    EDUCATIONAL(Asset.BLUE);

    private final Asset colorResource;

    PropertyCategory(Asset colorResource) {
        this.colorResource = colorResource;
    }

    public Asset colorResource() {
        return colorResource;
    }
}
