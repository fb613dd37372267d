package com.example.PolicyDesk.model;

public enum StorageOrigin {
    PRIMARY,
    LOCAL
}
