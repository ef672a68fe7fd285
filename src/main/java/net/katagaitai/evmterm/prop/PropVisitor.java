package net.katagaitai.evmterm.prop;

public interface PropVisitor<R, X extends Exception> {
    R visitPBool(Prop.PBool prop) throws X;

    R visitPEq(Prop.PEq prop) throws X;

    R visitPLT(Prop.PLT prop) throws X;

    R visitPGT(Prop.PGT prop) throws X;

    R visitPLEq(Prop.PLEq prop) throws X;

    R visitPGEq(Prop.PGEq prop) throws X;

    R visitPNeg(Prop.PNeg prop) throws X;

    R visitPAnd(Prop.PAnd prop) throws X;

    R visitPOr(Prop.POr prop) throws X;

    R visitPImpl(Prop.PImpl prop) throws X;
}
