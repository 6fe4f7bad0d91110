package com.gentoro.lawmcp.service;

public record PcodeLookup(String name, String pcode, boolean found) {}
