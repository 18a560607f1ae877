package com.pocketledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.NotEmpty;

import java.time.LocalDate;
import java.util.List;

/**
 * DTO for the multi-account balance report. Dates are optional calendar days (UTC).
 */
public class BalancesRequest {

    @NotEmpty(message = "At least one account ID is required")
    private List<Long> accountIds;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate startDate;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate endDate;

    public BalancesRequest() {
    }

    public BalancesRequest(List<Long> accountIds, LocalDate startDate, LocalDate endDate) {
        this.accountIds = accountIds;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    public List<Long> getAccountIds() {
        return accountIds;
    }

    public void setAccountIds(List<Long> accountIds) {
        this.accountIds = accountIds;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }
}
