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
 * Marks a field or method as an option of a CLI command.
 *
 * Format:
 *
 * <name> [ , <alt-name> ]* [ = <param-name> ] [ : <description> ]
 *
 * Examples:
 *
 * comment,c=text: changeset comment
 * diffset-size=number: maximum number of entities per upload
 *
 * A method option is invoked each time the option appears, so options
 * that may be repeated (such as `--tag`) should be methods.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.FIELD, ElementType.METHOD})
public @interface Option
{
    String value() default "";
}
