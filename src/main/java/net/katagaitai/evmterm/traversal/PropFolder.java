package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.prop.PropVisitor;

class PropFolder<B> implements PropVisitor<Void, RuntimeException> {
    private final ExprFolder<B> exprs;

    PropFolder(ExprFolder<B> exprs) {
        this.exprs = exprs;
    }

    void fold(Prop prop) {
        exprs.guard().enter();
        try {
            prop.accept(this);
        } finally {
            exprs.guard().exit();
        }
    }

    void foldAll(Iterable<? extends Prop> props) {
        for (Prop prop : props) {
            fold(prop);
        }
    }

    @Override
    public Void visitPBool(Prop.PBool prop) {
        return null;
    }

    @Override
    public Void visitPEq(Prop.PEq prop) {
        exprs.fold(prop.getLhs());
        exprs.fold(prop.getRhs());
        return null;
    }

    @Override
    public Void visitPLT(Prop.PLT prop) {
        exprs.fold(prop.getLhs());
        exprs.fold(prop.getRhs());
        return null;
    }

    @Override
    public Void visitPGT(Prop.PGT prop) {
        exprs.fold(prop.getLhs());
        exprs.fold(prop.getRhs());
        return null;
    }

    @Override
    public Void visitPLEq(Prop.PLEq prop) {
        exprs.fold(prop.getLhs());
        exprs.fold(prop.getRhs());
        return null;
    }

    @Override
    public Void visitPGEq(Prop.PGEq prop) {
        exprs.fold(prop.getLhs());
        exprs.fold(prop.getRhs());
        return null;
    }

    @Override
    public Void visitPNeg(Prop.PNeg prop) {
        fold(prop.getOperand());
        return null;
    }

    @Override
    public Void visitPAnd(Prop.PAnd prop) {
        fold(prop.getLhs());
        fold(prop.getRhs());
        return null;
    }

    @Override
    public Void visitPOr(Prop.POr prop) {
        fold(prop.getLhs());
        fold(prop.getRhs());
        return null;
    }

    @Override
    public Void visitPImpl(Prop.PImpl prop) {
        fold(prop.getLhs());
        fold(prop.getRhs());
        return null;
    }
}
