package io.zeroledger;

import io.zeroledger.cli.ZeroLedgerCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = ZeroLedgerCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
