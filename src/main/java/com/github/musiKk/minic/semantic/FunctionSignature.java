package com.github.musiKk.minic.semantic;

import java.util.List;

import com.github.musiKk.minic.parser.CompilationUnit.FunctionDefinition;

public record FunctionSignature(String name, Type returnType, List<Parameter> parameters, int line) {

    public record Parameter(Type type, String name) {}

    public static FunctionSignature of(FunctionDefinition definition) {
        var parameters = definition.parameters().stream()
                .map(p -> new Parameter(Type.of(p.type()), p.name()))
                .toList();
        return new FunctionSignature(definition.name(), Type.of(definition.returnType()), parameters, definition.line());
    }

    public List<Type> parameterTypes() {
        return parameters.stream().map(Parameter::type).toList();
    }
}
