package com.gentoro.llmc.parser;

import com.gentoro.llmc.ast.AstNode;
import com.gentoro.llmc.ast.Severity;

public record ValidationIssue(Severity severity, String message, AstNode node) {}
