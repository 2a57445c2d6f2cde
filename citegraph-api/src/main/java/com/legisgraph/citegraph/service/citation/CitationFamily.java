package com.legisgraph.citegraph.service.citation;

public enum CitationFamily {
    US_CODE,
    PUBLIC_LAW,
    BILL,
    CFR,
    FEDERAL_REGISTER,
    STATUTES_AT_LARGE
}
