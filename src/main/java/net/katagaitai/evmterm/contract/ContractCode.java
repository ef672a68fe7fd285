package net.katagaitai.evmterm.contract;

import com.google.common.collect.ImmutableList;
import lombok.NonNull;
import lombok.Value;
import net.katagaitai.evmterm.expr.EAddr;
import net.katagaitai.evmterm.expr.EBuf;
import net.katagaitai.evmterm.expr.EByte;
import net.katagaitai.evmterm.expr.Expr;
import net.katagaitai.evmterm.util.Util;

import java.util.List;

public abstract class ContractCode {
    ContractCode() {
    }

    public abstract <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

    public interface Visitor<R, X extends Exception> {
        R visitUnknownCode(UnknownCode code) throws X;

        R visitInitCode(InitCode code) throws X;

        R visitConcreteRuntimeCode(ConcreteRuntimeCode code) throws X;

        R visitSymbolicRuntimeCode(SymbolicRuntimeCode code) throws X;
    }

    @Value
    public static class UnknownCode extends ContractCode {
        @NonNull
        Expr<EAddr> address;

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitUnknownCode(this);
        }
    }

    @Value
    public static class InitCode extends ContractCode {
        byte[] code;
        Expr<EBuf> args;

        public InitCode(@NonNull byte[] code, @NonNull Expr<EBuf> args) {
            this.code = code.clone();
            this.args = args;
        }

        public byte[] getCode() {
            return code.clone();
        }

        public String getHex() {
            return Util.toHexString(code);
        }

        @Override
        public String toString() {
            return "ContractCode.InitCode(" + Util.addHexPrefix(getHex()) + ", " + args + ")";
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitInitCode(this);
        }
    }

    @Value
    public static class ConcreteRuntimeCode extends ContractCode {
        byte[] code;

        public ConcreteRuntimeCode(@NonNull byte[] code) {
            this.code = code.clone();
        }

        public byte[] getCode() {
            return code.clone();
        }

        public String getHex() {
            return Util.toHexString(code);
        }

        @Override
        public String toString() {
            return "ContractCode.ConcreteRuntimeCode(" + Util.addHexPrefix(getHex()) + ")";
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitConcreteRuntimeCode(this);
        }
    }

    @Value
    public static class SymbolicRuntimeCode extends ContractCode {
        ImmutableList<Expr<EByte>> code;

        public SymbolicRuntimeCode(@NonNull List<? extends Expr<EByte>> code) {
            this.code = ImmutableList.copyOf(code);
        }

        @Override
        public <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X {
            return visitor.visitSymbolicRuntimeCode(this);
        }
    }
}
