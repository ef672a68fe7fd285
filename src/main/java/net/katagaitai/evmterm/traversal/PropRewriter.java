package net.katagaitai.evmterm.traversal;

import com.google.common.collect.ImmutableList;
import net.katagaitai.evmterm.prop.Prop;
import net.katagaitai.evmterm.prop.PropVisitor;

import java.util.List;

class PropRewriter<X extends Exception> implements PropVisitor<Prop, X> {
    private final ExprRewriter<X> exprs;

    PropRewriter(ExprRewriter<X> exprs) {
        this.exprs = exprs;
    }

    Prop map(Prop prop) throws X {
        exprs.guard().enter();
        try {
            return prop.accept(this);
        } finally {
            exprs.guard().exit();
        }
    }

    ImmutableList<Prop> mapAll(List<Prop> props) throws X {
        ImmutableList.Builder<Prop> builder = ImmutableList.builder();
        for (Prop prop : props) {
            builder.add(map(prop));
        }
        return builder.build();
    }

    @Override
    public Prop visitPBool(Prop.PBool prop) {
        return prop;
    }

    @Override
    public Prop visitPEq(Prop.PEq prop) throws X {
        return new Prop.PEq(exprs.map(prop.getLhs()), exprs.map(prop.getRhs()));
    }

    @Override
    public Prop visitPLT(Prop.PLT prop) throws X {
        return new Prop.PLT(exprs.map(prop.getLhs()), exprs.map(prop.getRhs()));
    }

    @Override
    public Prop visitPGT(Prop.PGT prop) throws X {
        return new Prop.PGT(exprs.map(prop.getLhs()), exprs.map(prop.getRhs()));
    }

    @Override
    public Prop visitPLEq(Prop.PLEq prop) throws X {
        return new Prop.PLEq(exprs.map(prop.getLhs()), exprs.map(prop.getRhs()));
    }

    @Override
    public Prop visitPGEq(Prop.PGEq prop) throws X {
        return new Prop.PGEq(exprs.map(prop.getLhs()), exprs.map(prop.getRhs()));
    }

    @Override
    public Prop visitPNeg(Prop.PNeg prop) throws X {
        return new Prop.PNeg(map(prop.getOperand()));
    }

    @Override
    public Prop visitPAnd(Prop.PAnd prop) throws X {
        return new Prop.PAnd(map(prop.getLhs()), map(prop.getRhs()));
    }

    @Override
    public Prop visitPOr(Prop.POr prop) throws X {
        return new Prop.POr(map(prop.getLhs()), map(prop.getRhs()));
    }

    @Override
    public Prop visitPImpl(Prop.PImpl prop) throws X {
        return new Prop.PImpl(map(prop.getLhs()), map(prop.getRhs()));
    }
}
