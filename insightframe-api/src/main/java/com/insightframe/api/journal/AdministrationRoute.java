package com.insightframe.api.journal;

public enum AdministrationRoute {
    ORAL,
    SUBLINGUAL,
    BUCCAL,
    INSUFFLATED,
    RECTAL,
    TRANSDERMAL,
    SUBCUTANEOUS,
    INTRAMUSCULAR,
    INTRAVENOUS,
    SMOKED,
    INHALED
}
