package com.example.regreport.model;

public record CategoryLineItems(InvestmentCategory category, WindowedSums sums, LineItems items) {
}
