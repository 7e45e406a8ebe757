package org.javai.typefilter.type;

/**
 * Visitor over {@link TypeExpr} variants.
 * <p>
 * Used for operations such as serialization, literal indexing and pruning.
 *
 * @param <R> the return type of the visitor operations
 */
public interface TypeExprVisitor<R> {

	R visitReference(TypeExpr.Reference reference);

	R visitUnion(TypeExpr.Union union);

	R visitStruct(TypeExpr.Struct struct);

	R visitArray(TypeExpr.ArrayOf array);

	R visitLiteral(TypeExpr.Literal literal);

	R visitSpecial(TypeExpr.Special special);

	R visitTemplate(TypeExpr.Template template);
}
