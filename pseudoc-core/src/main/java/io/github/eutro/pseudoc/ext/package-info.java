/**
 * The ext API allows for associating typed annotations with
 * instances of {@link io.github.eutro.pseudoc.ext.ExtContainer}.
 *
 * <pre>{@code
 * Insn insn = new Insn(dest, CommonOps.ASSIGN, src);
 * insn.attachExt(CommonExts.DEAD, true);
 *
 * insn.getExtOrThrow(CommonExts.DEAD); // => true
 * insn.getNullable(CommonExts.ORIGINAL_INSN); // => null
 * }</pre>
 * <p>
 * Passes use these to record provenance and scratch data on instructions, blocks, graph nodes and
 * edges, without the IR classes having to know about every pass.
 * Annotations never take part in the equality of the IR element they are attached to.
 * <p>
 * Specialised implementations of {@link io.github.eutro.pseudoc.ext.ExtContainer}
 * may implement fast-paths for certain {@link io.github.eutro.pseudoc.ext.Ext}s
 * by storing them directly in fields of the class.
 */
package io.github.eutro.pseudoc.ext;
