package com.gentoro.lawmcp.moj;

/** A law listed on the keyword search result page. */
public record LawLink(String name, String pcode) {}
