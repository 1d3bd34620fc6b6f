package faxc.ast;

import faxc.ast.decl.*;
import faxc.ast.stmt.Stmt;

import java.util.List;

/**
 * Корень дерева. Верхний уровень уже разложен по областям вывода:
 * импорты, объявления (в исходном порядке) и свободные операторы,
 * которые попадут в синтезированную точку входа.
 */
public record Program(
        List<ImportDecl> imports,
        List<Decl> declarations,
        List<Stmt> statements
) {}
