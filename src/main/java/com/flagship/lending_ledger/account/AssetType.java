package com.flagship.lending_ledger.account;

public enum AssetType {
    BASE,
    CRYPTO
}
