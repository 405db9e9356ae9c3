package me.christianrobert.trigconv.ir;

public interface StatementVisitor<R> {

    R visitLeaf(SqlLeaf leaf);

    R visitIfElse(IfElse ifElse);

    R visitCaseWhen(CaseWhen caseWhen);

    R visitForLoop(ForLoop forLoop);

    R visitWhileLoop(WhileLoop whileLoop);

    R visitBasicLoop(BasicLoop basicLoop);

    R visitBlock(BeginEndBlock block);
}
