package net.katagaitai.evmterm.expr;

public interface ExprVisitor<R, X extends Exception> {
    // literals & variables
    R visitLit(Expr.Lit expr) throws X;
    R visitLitByte(Expr.LitByte expr) throws X;
    R visitVar(Expr.Var expr) throws X;
    R visitGVar(Expr.GVar<?> expr) throws X;

    // contracts
    R visitC(Expr.C expr) throws X;

    // bytes
    R visitIndexWord(Expr.IndexWord expr) throws X;
    R visitEqByte(Expr.EqByte expr) throws X;
    R visitJoinBytes(Expr.JoinBytes expr) throws X;

    // control flow
    R visitSuccess(Expr.Success expr) throws X;
    R visitFailure(Expr.Failure expr) throws X;
    R visitPartial(Expr.Partial expr) throws X;
    R visitITE(Expr.ITE expr) throws X;

    // arithmetic
    R visitAdd(Expr.Add expr) throws X;
    R visitSub(Expr.Sub expr) throws X;
    R visitMul(Expr.Mul expr) throws X;
    R visitDiv(Expr.Div expr) throws X;
    R visitSDiv(Expr.SDiv expr) throws X;
    R visitMod(Expr.Mod expr) throws X;
    R visitSMod(Expr.SMod expr) throws X;
    R visitAddMod(Expr.AddMod expr) throws X;
    R visitMulMod(Expr.MulMod expr) throws X;
    R visitExp(Expr.Exp expr) throws X;
    R visitSEx(Expr.SEx expr) throws X;
    R visitMin(Expr.Min expr) throws X;
    R visitMax(Expr.Max expr) throws X;

    // comparisons
    R visitLT(Expr.LT expr) throws X;
    R visitGT(Expr.GT expr) throws X;
    R visitLEq(Expr.LEq expr) throws X;
    R visitGEq(Expr.GEq expr) throws X;
    R visitSLT(Expr.SLT expr) throws X;
    R visitSGT(Expr.SGT expr) throws X;
    R visitEq(Expr.Eq expr) throws X;
    R visitIsZero(Expr.IsZero expr) throws X;

    // bits
    R visitAnd(Expr.And expr) throws X;
    R visitOr(Expr.Or expr) throws X;
    R visitXor(Expr.Xor expr) throws X;
    R visitNot(Expr.Not expr) throws X;
    R visitSHL(Expr.SHL expr) throws X;
    R visitSHR(Expr.SHR expr) throws X;
    R visitSAR(Expr.SAR expr) throws X;

    // hashes
    R visitKeccak(Expr.Keccak expr) throws X;
    R visitSHA256(Expr.SHA256 expr) throws X;

    // block context
    R visitOrigin(Expr.Origin expr) throws X;
    R visitCoinbase(Expr.Coinbase expr) throws X;
    R visitTimestamp(Expr.Timestamp expr) throws X;
    R visitBlockNumber(Expr.BlockNumber expr) throws X;
    R visitPrevRandao(Expr.PrevRandao expr) throws X;
    R visitGasLimit(Expr.GasLimit expr) throws X;
    R visitChainId(Expr.ChainId expr) throws X;
    R visitBaseFee(Expr.BaseFee expr) throws X;
    R visitBlockHash(Expr.BlockHash expr) throws X;

    // tx context
    R visitTxValue(Expr.TxValue expr) throws X;

    // frame context
    R visitGas(Expr.Gas expr) throws X;
    R visitBalance(Expr.Balance expr) throws X;

    // code
    R visitCodeSize(Expr.CodeSize expr) throws X;
    R visitCodeHash(Expr.CodeHash expr) throws X;

    // logs
    R visitLogEntry(Expr.LogEntry expr) throws X;

    // contract creation
    R visitCreate(Expr.Create expr) throws X;
    R visitCreate2(Expr.Create2 expr) throws X;

    // calls
    R visitCall(Expr.Call expr) throws X;
    R visitCallCode(Expr.CallCode expr) throws X;
    R visitDelegateCall(Expr.DelegateCall expr) throws X;

    // addresses
    R visitLitAddr(Expr.LitAddr expr) throws X;
    R visitSymAddr(Expr.SymAddr expr) throws X;
    R visitWAddr(Expr.WAddr expr) throws X;

    // storage
    R visitConcreteStore(Expr.ConcreteStore expr) throws X;
    R visitAbstractStore(Expr.AbstractStore expr) throws X;
    R visitSLoad(Expr.SLoad expr) throws X;
    R visitSStore(Expr.SStore expr) throws X;

    // buffers
    R visitConcreteBuf(Expr.ConcreteBuf expr) throws X;
    R visitAbstractBuf(Expr.AbstractBuf expr) throws X;
    R visitReadWord(Expr.ReadWord expr) throws X;
    R visitReadByte(Expr.ReadByte expr) throws X;
    R visitWriteWord(Expr.WriteWord expr) throws X;
    R visitWriteByte(Expr.WriteByte expr) throws X;
    R visitCopySlice(Expr.CopySlice expr) throws X;
    R visitBufLength(Expr.BufLength expr) throws X;
}
