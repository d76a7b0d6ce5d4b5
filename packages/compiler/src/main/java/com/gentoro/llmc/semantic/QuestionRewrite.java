package com.gentoro.llmc.semantic;

import com.gentoro.llmc.ast.QuestionNode;

/** A normalized replacement for a question node, applied by the owner of the tree. */
public record QuestionRewrite(QuestionNode original, QuestionNode normalized) {}
