package com.deepansh.pawsagent.records;

public enum Species {
    CAT,
    DOG
}
