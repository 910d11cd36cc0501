package org.forcecom.restapi.rest;

import org.forcecom.restapi.freemarker.FreeMarkerEngine;

import java.util.Map;

/**
 * REST resources that execute SOQL. Paths are relative to the instance URL.
 */
public enum SoqlEndpoint {

    /** Live records only. */
    QUERY("services/data/v${apiVersion}/query/?q=${soql?url}"),

    /** Also returns deleted and archived records. */
    QUERY_ALL("services/data/v${apiVersion}/queryAll/?q=${soql?url}");

    private final String template;

    SoqlEndpoint(String template) {
        this.template = template;
    }

    /**
     * Renders the first-page path for a statement.
     *
     * @param apiVersion API version, e.g. {@code "35.0"}
     * @param soql       SOQL statement, URL-encoded as UTF-8 in the result
     * @return Relative path including the query string
     */
    public String path(String apiVersion, String soql) {
        return FreeMarkerEngine.getInstance().render(template, Map.of("apiVersion", apiVersion, "soql", soql));
    }
}
