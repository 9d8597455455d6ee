package com.funcpool.cli;

import com.funcpool.cli.model.FunctionTarget;
import com.funcpool.cli.output.PoolResultsPrinter;
import com.funcpool.service.PoolService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

@Command(name = "translate", description = "Add a mapping of a function in another language.")
public class TranslateCommand extends PoolSubcommand {

    @Parameters(index = "0", paramLabel = "HASH@LANG[@MAPPING]", description = "Function and the mapping to translate from")
    private String source;

    @Parameters(index = "1", paramLabel = "TARGET_LANG")
    private String targetLanguage;

    @Option(names = {"--name", "-n"}, paramLabel = "OLD=NEW", required = true,
            description = "New name for an identifier of the source mapping; repeat for every identifier")
    private List<String> names = new ArrayList<>();

    @Option(names = {"--docstring", "-d"}, description = "Docstring in the target language")
    private String docstring;

    @Option(names = {"--comment", "-m"})
    private String comment;

    @Override
    protected int execute(PoolService service, PoolResultsPrinter printer) {
        FunctionTarget function = targets.function(source, true);
        String language = targets.language(targetLanguage);
        String mappingHash = service.translate(function.getHash(), function.getLanguage(), function.getMappingHash(),
                language, targets.renames(names), docstring, comment);
        printer.printMapping(function.getHash(), language, mappingHash);
        return 0;
    }
}
