package org.mbasiconjava.frontend.analysis;

import org.mbasiconjava.frontend.astnode.Statement;

/**
 * Exhaustive dispatch over the statement variants.
 */
public interface StatementVisitor {
    void visit(Statement.Print node);

    void visit(Statement.PrintUsing node);

    void visit(Statement.Lprint node);

    void visit(Statement.LprintUsing node);

    void visit(Statement.Input node);

    void visit(Statement.LineInput node);

    void visit(Statement.Let node);

    void visit(Statement.If node);

    void visit(Statement.For node);

    void visit(Statement.Next node);

    void visit(Statement.While node);

    void visit(Statement.Wend node);

    void visit(Statement.Goto node);

    void visit(Statement.Gosub node);

    void visit(Statement.Return node);

    void visit(Statement.OnGoto node);

    void visit(Statement.OnGosub node);

    void visit(Statement.Data node);

    void visit(Statement.Read node);

    void visit(Statement.Restore node);

    void visit(Statement.Dim node);

    void visit(Statement.DefFn node);

    void visit(Statement.DefType node);

    void visit(Statement.End node);

    void visit(Statement.Stop node);

    void visit(Statement.Cls node);

    void visit(Statement.Rem node);

    void visit(Statement.Swap node);

    void visit(Statement.Erase node);

    void visit(Statement.Clear node);

    void visit(Statement.OptionBase node);

    void visit(Statement.Randomize node);

    void visit(Statement.Tron node);

    void visit(Statement.Troff node);

    void visit(Statement.Width node);

    void visit(Statement.Poke node);

    void visit(Statement.Out node);

    void visit(Statement.Wait node);

    void visit(Statement.Call node);

    void visit(Statement.Error node);

    void visit(Statement.OnError node);

    void visit(Statement.Resume node);

    void visit(Statement.Open node);

    void visit(Statement.Close node);

    void visit(Statement.Reset node);

    void visit(Statement.Field node);

    void visit(Statement.Get node);

    void visit(Statement.Put node);

    void visit(Statement.Lset node);

    void visit(Statement.Rset node);

    void visit(Statement.Write node);

    void visit(Statement.Chain node);

    void visit(Statement.Common node);

    void visit(Statement.MidAssign node);

    void visit(Statement.Kill node);

    void visit(Statement.Name node);

    void visit(Statement.Merge node);

    void visit(Statement.Run node);
}
