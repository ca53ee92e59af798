package com.credit.modelengine.builder;

import java.util.function.BiConsumer;
import java.util.function.Function;

import com.credit.modelengine.model.FinancialPeriod;

/**
 * Fields of a {@link FinancialPeriod} that facts can populate, each bound to
 * its accessor pair on the owning sub-record.
 */
public enum ModelField {
    REVENUE(Statement.INCOME, p -> p.getIncome().getRevenue(), (p, v) -> p.getIncome().setRevenue(v)),
    COGS(Statement.INCOME, p -> p.getIncome().getCogs(), (p, v) -> p.getIncome().setCogs(v)),
    OPERATING_EXPENSES(Statement.INCOME, p -> p.getIncome().getOperatingExpenses(),
            (p, v) -> p.getIncome().setOperatingExpenses(v)),
    DEPRECIATION(Statement.INCOME, p -> p.getIncome().getDepreciation(), (p, v) -> p.getIncome().setDepreciation(v)),
    INTEREST(Statement.INCOME, p -> p.getIncome().getInterest(), (p, v) -> p.getIncome().setInterest(v)),
    NET_INCOME(Statement.INCOME, p -> p.getIncome().getNetIncome(), (p, v) -> p.getIncome().setNetIncome(v)),

    CASH(Statement.BALANCE, p -> p.getBalance().getCash(), (p, v) -> p.getBalance().setCash(v)),
    ACCOUNTS_RECEIVABLE(Statement.BALANCE, p -> p.getBalance().getAccountsReceivable(),
            (p, v) -> p.getBalance().setAccountsReceivable(v)),
    INVENTORY(Statement.BALANCE, p -> p.getBalance().getInventory(), (p, v) -> p.getBalance().setInventory(v)),
    CURRENT_ASSETS(Statement.BALANCE, p -> p.getBalance().getCurrentAssets(),
            (p, v) -> p.getBalance().setCurrentAssets(v)),
    TOTAL_ASSETS(Statement.BALANCE, p -> p.getBalance().getTotalAssets(), (p, v) -> p.getBalance().setTotalAssets(v)),
    SHORT_TERM_DEBT(Statement.BALANCE, p -> p.getBalance().getShortTermDebt(),
            (p, v) -> p.getBalance().setShortTermDebt(v)),
    LONG_TERM_DEBT(Statement.BALANCE, p -> p.getBalance().getLongTermDebt(),
            (p, v) -> p.getBalance().setLongTermDebt(v)),
    CURRENT_LIABILITIES(Statement.BALANCE, p -> p.getBalance().getCurrentLiabilities(),
            (p, v) -> p.getBalance().setCurrentLiabilities(v)),
    TOTAL_LIABILITIES(Statement.BALANCE, p -> p.getBalance().getTotalLiabilities(),
            (p, v) -> p.getBalance().setTotalLiabilities(v)),
    EQUITY(Statement.BALANCE, p -> p.getBalance().getEquity(), (p, v) -> p.getBalance().setEquity(v)),

    EBITDA(Statement.CASHFLOW, p -> p.getCashflow().getEbitda(), (p, v) -> p.getCashflow().setEbitda(v)),
    CAPEX(Statement.CASHFLOW, p -> p.getCashflow().getCapex(), (p, v) -> p.getCashflow().setCapex(v)),
    CFADS(Statement.CASHFLOW, p -> p.getCashflow().getCfads(), (p, v) -> p.getCashflow().setCfads(v));

    public enum Statement {
        INCOME, BALANCE, CASHFLOW
    }

    private final Statement statement;
    private final Function<FinancialPeriod, Double> getter;
    private final BiConsumer<FinancialPeriod, Double> setter;

    ModelField(Statement statement, Function<FinancialPeriod, Double> getter,
            BiConsumer<FinancialPeriod, Double> setter) {
        this.statement = statement;
        this.getter = getter;
        this.setter = setter;
    }

    public Statement statement() {
        return statement;
    }

    public Double get(FinancialPeriod period) {
        return getter.apply(period);
    }

    public void set(FinancialPeriod period, Double value) {
        setter.accept(period, value);
    }
}
