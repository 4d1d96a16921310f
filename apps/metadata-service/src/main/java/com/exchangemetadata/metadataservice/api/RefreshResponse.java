package com.exchangemetadata.metadataservice.api;

public record RefreshResponse(String kind, String outcome) {}
