/**
 * Core AST infrastructure shared by the expression and declaration
 * nodes: the per-compilation arena, source positions, names, declarations
 * and the compact storage used for numeric constants.
 */
package exm.ftn.ast;
