package com.delta.siteaudit.generation.model;

public record PackageOptions(PagePackage entry, PagePackage recommendation, PagePackage authority) {
}
