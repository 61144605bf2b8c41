package com.crustdata.mcp.model.request;

/**
 * HTTP methods used by the Crustdata endpoints.
 */
public enum HttpMethod {
    GET,
    POST
}
