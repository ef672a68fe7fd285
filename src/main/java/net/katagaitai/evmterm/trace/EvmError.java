package net.katagaitai.evmterm.trace;

public enum EvmError {
    BALANCE_TOO_LOW,
    UNRECOGNIZED_OPCODE,
    SELFDESTRUCTION,
    STACK_UNDERRUN,
    BAD_JUMP_DESTINATION,
    REVERT,
    OUT_OF_GAS,
    STACK_LIMIT_EXCEEDED,
    ILLEGAL_OVERFLOW,
    STATE_CHANGE_WHILE_STATIC,
    INVALID_MEMORY_ACCESS,
    CALL_DEPTH_LIMIT_REACHED,
    MAX_CODE_SIZE_EXCEEDED,
    MAX_INIT_CODE_SIZE_EXCEEDED,
    INVALID_FORMAT,
    PRECOMPILE_FAILURE,
    RETURN_DATA_OUT_OF_BOUNDS,
    NONCE_OVERFLOW
}
