package com.warden.spring;

import com.warden.authz.field.TableFieldAccessConfig;

/**
 * Field rules for one table, picked up from the application context.
 */
public interface FieldAccessTableRegistration {

    String table();

    TableFieldAccessConfig config();

    static FieldAccessTableRegistration of(String table, TableFieldAccessConfig config) {
        return new FieldAccessTableRegistration() {
            @Override
            public String table() {
                return table;
            }

            @Override
            public TableFieldAccessConfig config() {
                return config;
            }
        };
    }
}
