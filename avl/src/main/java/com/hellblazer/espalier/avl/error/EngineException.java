/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of Espalier.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.espalier.avl.error;

/**
 * Base sealed class for all engine errors. The hierarchy is closed so that dispatchers can map every rejection onto an
 * {@link ErrorKind} without a fallback case.
 *
 * @author hal.hildebrand
 */
public abstract sealed class EngineException extends Exception
permits DuplicateValueException, NotFoundException, InvalidRotationException, IncorrectRotationException,
        OperationPendingException, ModeSwitchBlockedException, NothingToUndoException, NothingToRedoException {

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the category of this error
     */
    public abstract ErrorKind kind();
}
