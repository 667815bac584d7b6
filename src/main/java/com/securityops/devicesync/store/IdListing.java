package com.securityops.devicesync.store;

import java.util.List;

public record IdListing(
    List<String> ids,
    double cost
) {}
