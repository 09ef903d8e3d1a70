package com.logtail.core.models;

public enum AuthMethod {
    KEY,
    PASSWORD
}
