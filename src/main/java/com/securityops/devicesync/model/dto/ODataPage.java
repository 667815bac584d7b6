package com.securityops.devicesync.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of an OData collection response (Graph and Defender APIs share the shape).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ODataPage<T>(
    List<T> value,
    @JsonProperty("@odata.nextLink") String nextLink
) {}
