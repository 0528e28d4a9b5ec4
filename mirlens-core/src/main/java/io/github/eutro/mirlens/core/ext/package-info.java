/**
 * The ext API associates analysis facts with the objects they describe,
 * without those objects needing a field for every analysis.
 *
 * <pre>{@code
 * Function func = program.getFunction(0);
 * func.attachExt(CommonExts.LOOP_BLOCKS, loops);
 *
 * Set<Integer> loops = func.getExtOrThrow(CommonExts.LOOP_BLOCKS);
 * }</pre>
 * <p>
 * The IR in {@link io.github.eutro.mirlens.core.ir} is immutable and never carries exts;
 * facts are attached to the {@link io.github.eutro.mirlens.core.cfg.Function} wrapping a body.
 * {@link io.github.eutro.mirlens.core.ext.MetadataState} records which facts are present,
 * so every analysis runs at most once per function.
 */
package io.github.eutro.mirlens.core.ext;
