package com.sievesql.test;

import com.sievesql.catalog.Catalog;
import com.sievesql.catalog.CatalogBuilder;
import com.sievesql.types.DateDomain;
import com.sievesql.types.DecimalDomain;
import com.sievesql.types.IntegerDomain;
import com.sievesql.types.TextDomain;

import java.util.List;

/**
 * A small university database used across the tests.
 *
 * <pre>
 *   school(code PK, name, campus)
 *   department(code PK, name, school_code FK school)
 *   program(school_code FK school, code, title, degree; PK school_code, code)
 *   course(department_code FK department, no, title, credits, budget, starts; PK department_code, no)
 * </pre>
 */
public final class UniversityCatalog {

    private UniversityCatalog() {
    }

    public static Catalog catalog() {
        CatalogBuilder builder = new CatalogBuilder();
        builder.table("school")
            .column("code", new TextDomain(), false)
            .column("name", new TextDomain(), false)
            .column("campus", new TextDomain(), true)
            .primaryKey("code")
            .uniqueKey("name");
        builder.table("department")
            .column("code", new TextDomain(), false)
            .column("name", new TextDomain(), false)
            .column("school_code", new TextDomain(), true)
            .primaryKey("code")
            .foreignKey("school_code", "school", "code");
        builder.table("program")
            .column("school_code", new TextDomain(), false)
            .column("code", new TextDomain(), false)
            .column("title", new TextDomain(), false)
            .column("degree", new TextDomain(), true)
            .primaryKey("school_code", "code")
            .foreignKey("school_code", "school", "code");
        builder.table("course")
            .column("department_code", new TextDomain(), false)
            .column("no", new IntegerDomain(), false)
            .column("title", new TextDomain(), false)
            .column("credits", new IntegerDomain(), true)
            .column("budget", new DecimalDomain(), true)
            .column("starts", new DateDomain(), true)
            .primaryKey("department_code", "no")
            .foreignKey(List.of("department_code"), "department", List.of("code"));
        return builder.build();
    }
}
