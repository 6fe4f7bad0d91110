package com.gentoro.lawmcp.service;

public record PcodeValidation(String pcode, boolean valid) {}
