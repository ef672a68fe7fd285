package net.katagaitai.evmterm.traversal;

import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.contract.ContractCode;

class ContractFolder<B> implements ContractCode.Visitor<Void, RuntimeException> {
    private final ExprFolder<B> exprs;

    ContractFolder(ExprFolder<B> exprs) {
        this.exprs = exprs;
    }

    void foldContract(Contract contract) {
        foldCode(contract.getCode());
        exprs.fold(contract.getStorage());
        exprs.fold(contract.getOrigStorage());
        exprs.fold(contract.getBalance());
    }

    void foldAll(Iterable<Contract> contracts) {
        for (Contract contract : contracts) {
            foldContract(contract);
        }
    }

    void foldCode(ContractCode code) {
        code.accept(this);
    }

    @Override
    public Void visitUnknownCode(ContractCode.UnknownCode code) {
        exprs.fold(code.getAddress());
        return null;
    }

    @Override
    public Void visitInitCode(ContractCode.InitCode code) {
        exprs.fold(code.getArgs());
        return null;
    }

    @Override
    public Void visitConcreteRuntimeCode(ContractCode.ConcreteRuntimeCode code) {
        return null;
    }

    @Override
    public Void visitSymbolicRuntimeCode(ContractCode.SymbolicRuntimeCode code) {
        exprs.foldAll(code.getCode());
        return null;
    }
}
