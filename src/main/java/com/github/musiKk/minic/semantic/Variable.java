package com.github.musiKk.minic.semantic;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

@ToString
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public class Variable {
    private final String name;
    private final Type type;
    @Setter
    private boolean initialized;
}
