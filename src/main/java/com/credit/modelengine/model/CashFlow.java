package com.credit.modelengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/** Sparse cash-flow record holding derived and reported cash metrics. */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CashFlow {
    private Double ebitda;
    private Double capex;
    /** Cash flow available for debt service. */
    private Double cfads;
}
