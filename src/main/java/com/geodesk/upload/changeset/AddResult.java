/*
 * Copyright (c) Clarisma / GeoDesk contributors
 *
 * This source code is licensed under the AGPL 3.0 license found in the
 * LICENSE file in the root directory of this source tree.
 */

package com.geodesk.upload.changeset;

/**
 * Outcome of adding an entity to a {@link Changeset} or {@link DiffSet}.
 * A container that has been closed rejects further entities; its owner
 * must replace it with a fresh one and add the entity again.
 */
public enum AddResult
{
    ADDED,
    CLOSED
}
