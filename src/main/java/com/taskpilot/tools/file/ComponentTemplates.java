package com.taskpilot.tools.file;

import java.util.Locale;

/**
 * Starter source for components generated by {@code create_component}.
 */
final class ComponentTemplates {

    static final String REACT = "react";
    static final String REACT_NATIVE = "react-native";

    private static final String REACT_NATIVE_TEMPLATE = """
            import React from 'react';
            import { View, Text, StyleSheet } from 'react-native';

            export function %1$s() {
              return (
                <View style={styles.container}>
                  <Text>%1$s</Text>
                </View>
              );
            }

            const styles = StyleSheet.create({
              container: {
                flex: 1,
                alignItems: 'center',
                justifyContent: 'center',
              },
            });
            """;

    private static final String REACT_TEMPLATE = """
            import React from 'react';

            export function %1$s() {
              return (
                <div className="%2$s">
                  <h1>%1$s</h1>
                </div>
              );
            }
            """;

    private ComponentTemplates() {
    }

    static String render(String name, String type) {
        if (REACT_NATIVE.equals(type)) {
            return REACT_NATIVE_TEMPLATE.formatted(name);
        }
        return REACT_TEMPLATE.formatted(name, name.toLowerCase(Locale.ROOT));
    }
}
