package com.gentoro.lawmcp.moj;

/**
 * ASP.NET view state of the search form on the home page; it has to be posted back with every
 * search.
 *
 * @param eventValidation may be empty, the other two may not
 */
public record FormState(String viewState, String viewStateGenerator, String eventValidation) {}
