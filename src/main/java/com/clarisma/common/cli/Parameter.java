/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.clarisma.common.cli;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field or method as a positional parameter of a CLI command.
 *
 * Its string value has the following format:
 *
 * <position> = [ ? ] <param-name> [ : <description> ]
 *
 * A `?` marks the parameter as optional; optional parameters must come
 * after all required ones.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface Parameter
{
    String value() default "";
}
