package com.example.regreport.model;

public record TagRealized(String tag, TagAttributes attributes, RealizedSums sums) {
}
