package com.sievesql.parser;

import java.util.List;

/**
 * A lexical mode: an ordered list of rules tried one by one.
 *
 * @param name the group name
 * @param rules the rules, in priority order
 */
record ScanGroup(String name, List<ScanRule> rules) {

    ScanGroup {
        rules = List.copyOf(rules);
    }
}
