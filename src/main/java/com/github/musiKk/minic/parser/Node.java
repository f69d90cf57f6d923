package com.github.musiKk.minic.parser;

import java.util.List;

import com.github.musiKk.minic.parser.CompilationUnit.Expression;
import com.github.musiKk.minic.parser.CompilationUnit.Include;
import com.github.musiKk.minic.parser.CompilationUnit.Parameter;
import com.github.musiKk.minic.parser.CompilationUnit.Statement;
import com.github.musiKk.minic.parser.CompilationUnit.Using;

public sealed interface Node permits CompilationUnit, Include, Using, Parameter, Expression, Statement {

    int line();

    /** Short text used when the tree is printed. */
    String label();

    /** Ordered children; empty for leaves. */
    List<? extends Node> children();
}
