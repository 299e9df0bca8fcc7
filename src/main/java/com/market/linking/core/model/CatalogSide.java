package com.market.linking.core.model;

/**
 * Which of the two independently-sourced catalogs a record belongs to.
 */
public enum CatalogSide {
    LEFT,
    RIGHT
}
