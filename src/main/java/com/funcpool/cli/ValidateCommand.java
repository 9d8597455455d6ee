package com.funcpool.cli;

import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import com.funcpool.storage.ValidationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.Map;

@Command(name = "validate", description = "Check a function, or the whole pool, against the storage schema.")
public class ValidateCommand extends PoolSubcommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "HASH")
    private String hash;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        if (hash != null) {
            ValidationResult result = service.validate(targets.hash(hash));
            printer.printValidation(hash, result);
            return result.isOk() ? 0 : 1;
        }
        Map<String, ValidationResult> results = service.validateAll();
        printer.printPoolValidation(results);
        return results.values().stream().allMatch(ValidationResult::isOk) ? 0 : 1;
    }
}
