package com.example.regreport.model;

public record CategoryRealized(InvestmentCategory category, RealizedSums sums) {
}
