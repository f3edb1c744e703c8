package com.metascan.explorer.modules.search;

/**
 * Which position column of an index entry names the target record.
 */
public enum IndexTarget {
    EXTRINSIC,
    EVENT
}
