// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import com.amazon.mork.MorkLoader;
import com.amazon.mork.system.MorkLoaderBuilder;

/**
 * {@link MorkLoaderBuilder} extension for internal use only.
 */
public class _Private_MorkLoaderBuilder extends MorkLoaderBuilder {

    private _Private_MorkLoaderBuilder() {
        super();
    }

    private _Private_MorkLoaderBuilder(MorkLoaderBuilder that) {
        super(that);
    }

    @Override
    public MorkLoader build() {
        LiteralDecoder decoder = new LiteralDecoder(getCharset(), isLiteralDecodingEnabled());
        return new MorkLoaderImpl(decoder, isGroupIdValidationEnabled());
    }

    public static class Mutable extends _Private_MorkLoaderBuilder {

        public Mutable() {
        }

        public Mutable(MorkLoaderBuilder that) {
            super(that);
        }

        @Override
        public MorkLoaderBuilder immutable() {
            return new _Private_MorkLoaderBuilder(this);
        }

        @Override
        public MorkLoaderBuilder mutable() {
            return this;
        }

        @Override
        protected void mutationCheck() {
        }

    }
}
