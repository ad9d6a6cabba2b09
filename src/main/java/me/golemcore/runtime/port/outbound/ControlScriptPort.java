package me.golemcore.runtime.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.runtime.domain.model.ControlScriptInput;
import me.golemcore.runtime.domain.model.ControlScriptResult;

/**
 * Runs turn-control scripts in a sandbox.
 */
public interface ControlScriptPort {

    /**
     * Evaluates a script against the given input. Implementations bound the run
     * in wall-clock time and statements.
     *
     * @return what the script asked for; never {@code null}
     * @throws ControlScriptException
     *             if the script fails to compile, throws or exceeds its limits
     */
    ControlScriptResult evaluate(String profile, String source, ControlScriptInput input);

    /**
     * Failure of a turn-control script.
     */
    class ControlScriptException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public ControlScriptException(String message) {
            super(message);
        }

        public ControlScriptException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
