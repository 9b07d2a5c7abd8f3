/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: MX Legal Assist
 */

package com.acme.mxlegal.rules;

public interface Check<I, R> {
    String id();
    R run(I input);
}
