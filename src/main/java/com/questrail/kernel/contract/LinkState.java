package com.questrail.kernel.contract;

public enum LinkState {
    UP,
    DOWN
}
