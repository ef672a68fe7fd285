package net.katagaitai.evmterm.traversal;

import com.google.common.collect.Maps;
import net.katagaitai.evmterm.contract.Contract;
import net.katagaitai.evmterm.contract.ContractCode;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EStorage;
import net.katagaitai.evmterm.expr.EWord;
import net.katagaitai.evmterm.expr.Expr;

import java.util.Map;

class ContractRewriter<X extends Exception> implements ContractCode.Visitor<ContractCode, X> {
    private final ExprRewriter<X> exprs;

    ContractRewriter(ExprRewriter<X> exprs) {
        this.exprs = exprs;
    }

    Contract mapContract(Contract contract) throws X {
        ContractCode code = mapCode(contract.getCode());
        Expr<EStorage> storage = exprs.map(contract.getStorage());
        Expr<EStorage> origStorage = exprs.map(contract.getOrigStorage());
        Expr<EWord> balance = exprs.map(contract.getBalance());
        return new Contract(code, storage, origStorage, balance, contract.getNonce());
    }

    Map<Expr<EAddr>, Contract> mapContracts(Map<Expr<EAddr>, Contract> contracts) throws X {
        Map<Expr<EAddr>, Contract> result = Maps.newLinkedHashMap();
        for (Map.Entry<Expr<EAddr>, Contract> entry : contracts.entrySet()) {
            Expr<EAddr> key = exprs.map(entry.getKey());
            result.put(key, mapContract(entry.getValue()));
        }
        return result;
    }

    ContractCode mapCode(ContractCode code) throws X {
        return code.accept(this);
    }

    @Override
    public ContractCode visitUnknownCode(ContractCode.UnknownCode code) throws X {
        return new ContractCode.UnknownCode(exprs.map(code.getAddress()));
    }

    @Override
    public ContractCode visitInitCode(ContractCode.InitCode code) throws X {
        Expr<EBuf> args = exprs.map(code.getArgs());
        return new ContractCode.InitCode(code.getCode(), args);
    }

    @Override
    public ContractCode visitConcreteRuntimeCode(ContractCode.ConcreteRuntimeCode code) {
        return code;
    }

    @Override
    public ContractCode visitSymbolicRuntimeCode(ContractCode.SymbolicRuntimeCode code) throws X {
        return new ContractCode.SymbolicRuntimeCode(exprs.mapAll(code.getCode()));
    }
}
