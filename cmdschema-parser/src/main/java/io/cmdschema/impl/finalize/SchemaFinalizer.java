package io.cmdschema.impl.finalize;

import static io.cmdschema.util.TextUtil.lower;

import io.cmdschema.api.ArgSchema;
import io.cmdschema.api.CommandSchema;
import io.cmdschema.api.FlagSchema;
import io.cmdschema.api.SubcommandSchema;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Puts every level of a schema into its canonical order. */
public final class SchemaFinalizer {
  private static final Comparator<FlagSchema> FLAG_ORDER =
      Comparator.comparing(FlagSchema::canonicalName);
  private static final Comparator<ArgSchema> ARG_ORDER = Comparator.comparing(a -> lower(a.name()));
  private static final Comparator<SubcommandSchema> SUBCOMMAND_ORDER =
      Comparator.comparing(SubcommandSchema::name);

  private SchemaFinalizer() {}

  public static CommandSchema finalizeSchema(CommandSchema schema) {
    return schema.withEntities(
        sorted(schema.globalFlags(), FLAG_ORDER),
        finalizeSubcommands(schema.subcommands()),
        sorted(schema.positional(), ARG_ORDER));
  }

  static List<SubcommandSchema> finalizeSubcommands(List<SubcommandSchema> subcommands) {
    List<SubcommandSchema> out = new ArrayList<>(subcommands.size());
    for (SubcommandSchema sub : subcommands) {
      out.add(
          sub.withAliases(sorted(sub.aliases(), Comparator.naturalOrder()))
              .withChildren(
                  sorted(sub.flags(), FLAG_ORDER),
                  sorted(sub.positional(), ARG_ORDER),
                  finalizeSubcommands(sub.subcommands())));
    }
    out.sort(SUBCOMMAND_ORDER);
    return out;
  }

  private static <T> List<T> sorted(List<T> items, Comparator<? super T> order) {
    List<T> out = new ArrayList<>(items);
    out.sort(order);
    return out;
  }
}
