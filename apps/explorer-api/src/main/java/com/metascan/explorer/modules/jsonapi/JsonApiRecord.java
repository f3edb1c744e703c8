package com.metascan.explorer.modules.jsonapi;

/**
 * A store record that renders as a JSON:API resource object.
 */
public interface JsonApiRecord {

    String resourceType();

    String resourceId();
}
