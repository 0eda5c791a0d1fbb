package org.csu.sdplot.compiler.parser.ast;

/**
 * 带分类标签的原子节点。标签为 {@link AtomType#INVALID} 的原子在求值时会失败。
 */
public interface Atom extends TreeElement {

    AtomType getAtomType();

    default boolean isValid() {
        return getAtomType() != AtomType.INVALID;
    }
}
