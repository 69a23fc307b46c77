package com.ospicorp.trendreport.pipeline.model;

public record XYPoint(double x, double y) {}
