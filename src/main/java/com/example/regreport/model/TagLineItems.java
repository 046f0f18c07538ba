package com.example.regreport.model;

public record TagLineItems(String tag, TagAttributes attributes, WindowedSums sums, LineItems items) {
}
