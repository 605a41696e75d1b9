// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.system;

import com.amazon.mork.MorkLoader;
import com.amazon.mork.impl._Private_MorkLoaderBuilder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Build a new {@link MorkLoader}.
 * <p>
 * A {@code MorkLoaderBuilder} with the default configuration may be obtained
 * with {@link #standard()}, then configured by chaining calls to
 * {@code with*()} methods:
 * <pre>
 * MorkLoader loader = MorkLoaderBuilder.standard()
 *     .withCharset(StandardCharsets.ISO_8859_1)
 *     .withGroupIdValidationEnabled(false)
 *     .build();
 * MorkParseResult result = loader.load("abook.mab", bytes);
 * </pre>
 *
 * <h2>Mutability</h2>
 * Builders returned by {@link #standard()} and {@link #copy()} are mutable;
 * {@link #immutable()} returns one that rejects every {@code set*} call.
 * The {@code with*} methods work on both, returning a mutable copy of an
 * immutable builder.  Configured loaders are independent of the builder that
 * made them.
 */
public abstract class MorkLoaderBuilder
{
    private boolean literalDecodingEnabled = true;
    private boolean groupIdValidationEnabled = true;
    private Charset charset = StandardCharsets.UTF_8;

    protected MorkLoaderBuilder()
    {
    }

    protected MorkLoaderBuilder(MorkLoaderBuilder that)
    {
        this.literalDecodingEnabled = that.literalDecodingEnabled;
        this.groupIdValidationEnabled = that.groupIdValidationEnabled;
        this.charset = that.charset;
    }

    /**
     * The standard builder of {@link MorkLoader}s, with all configuration
     * properties having their default values.
     *
     * @return a new, mutable builder instance.
     */
    public static MorkLoaderBuilder standard()
    {
        return new _Private_MorkLoaderBuilder.Mutable();
    }

    /**
     * Creates a mutable copy of this builder.
     *
     * @return a new builder with the same configuration as {@code this}.
     */
    public MorkLoaderBuilder copy()
    {
        return new _Private_MorkLoaderBuilder.Mutable(this);
    }

    /**
     * Returns an immutable builder configured exactly like this one.
     *
     * @return this builder instance, if immutable;
     * otherwise an immutable copy of this builder.
     */
    public MorkLoaderBuilder immutable()
    {
        return this;
    }

    /**
     * Returns a mutable builder configured exactly like this one.
     *
     * @return this instance, if mutable;
     * otherwise a mutable copy of this instance.
     */
    public MorkLoaderBuilder mutable()
    {
        return copy();
    }

    /** NOT FOR APPLICATION USE! */
    protected void mutationCheck()
    {
        throw new UnsupportedOperationException("This builder is immutable");
    }


    /**
     * Declares whether escapes in literals are decoded, returning a new
     * mutable builder if this is immutable.
     *
     * @param enabled when false, cell values hold the literal text exactly as
     * written between {@code =} and {@code )}.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setLiteralDecodingEnabled(boolean)
     */
    public MorkLoaderBuilder withLiteralDecodingEnabled(boolean enabled)
    {
        MorkLoaderBuilder b = mutable();
        b.setLiteralDecodingEnabled(enabled);
        return b;
    }

    /**
     * @see #withLiteralDecodingEnabled(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setLiteralDecodingEnabled(boolean enabled)
    {
        mutationCheck();
        this.literalDecodingEnabled = enabled;
    }

    /**
     * @return true by default.
     */
    public boolean isLiteralDecodingEnabled()
    {
        return literalDecodingEnabled;
    }


    /**
     * Declares whether a group commit marker must carry the id of the group
     * it ends, returning a new mutable builder if this is immutable.
     * Ids are compared ignoring case.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setGroupIdValidationEnabled(boolean)
     */
    public MorkLoaderBuilder withGroupIdValidationEnabled(boolean enabled)
    {
        MorkLoaderBuilder b = mutable();
        b.setGroupIdValidationEnabled(enabled);
        return b;
    }

    /**
     * @see #withGroupIdValidationEnabled(boolean)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setGroupIdValidationEnabled(boolean enabled)
    {
        mutationCheck();
        this.groupIdValidationEnabled = enabled;
    }

    /**
     * @return true by default.
     */
    public boolean isGroupIdValidationEnabled()
    {
        return groupIdValidationEnabled;
    }


    /**
     * Declares the charset literal bytes are read in, returning a new
     * mutable builder if this is immutable.
     *
     * @param charset if null, UTF-8 is used.
     *
     * @return this builder instance, if mutable;
     * otherwise a mutable copy of this builder.
     *
     * @see #setCharset(Charset)
     */
    public MorkLoaderBuilder withCharset(Charset charset)
    {
        MorkLoaderBuilder b = mutable();
        b.setCharset(charset);
        return b;
    }

    /**
     * @param charset if null, UTF-8 is used.
     *
     * @see #withCharset(Charset)
     *
     * @throws UnsupportedOperationException if this builder is immutable.
     */
    public void setCharset(Charset charset)
    {
        mutationCheck();
        this.charset = (charset == null ? StandardCharsets.UTF_8 : charset);
    }

    /**
     * @return UTF-8 by default.
     */
    public Charset getCharset()
    {
        return charset;
    }


    /**
     * Builds a loader with this builder's current configuration.
     *
     * @return a new, thread-safe loader.
     */
    public abstract MorkLoader build();
}
