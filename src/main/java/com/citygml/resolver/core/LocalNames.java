package com.citygml.resolver.core;

import lombok.experimental.UtilityClass;

@UtilityClass
public class LocalNames {

    /**
     * Strip a namespace qualifier: {@code "bldg:Building"} -> {@code "Building"}.
     */
    public static String localName(String qualifiedName) {
        if (qualifiedName == null) {
            return "";
        }
        int colon = qualifiedName.lastIndexOf(':');
        return colon < 0 ? qualifiedName : qualifiedName.substring(colon + 1);
    }
}
