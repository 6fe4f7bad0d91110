package com.gentoro.lawmcp.moj;

/** A law found by name search. */
public record LawHit(String name, String pcode, String contentUrl) {}
