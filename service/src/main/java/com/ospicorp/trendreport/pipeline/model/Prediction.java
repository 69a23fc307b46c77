package com.ospicorp.trendreport.pipeline.model;

public record Prediction(double x, double actual, double predicted, double residual) {}
