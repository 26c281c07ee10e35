package com.glottocatalog.util;

public record PublisherAddress(String address, String publisher) {}
