package nl.nfi.yacc2ebnf.ebnf.model;

import static java.util.Objects.requireNonNull;
import static nl.nfi.yacc2ebnf.ebnf.model.Primary.Group;
import static nl.nfi.yacc2ebnf.ebnf.model.Primary.Name;
import static nl.nfi.yacc2ebnf.ebnf.model.Primary.Term;

public sealed interface Primary permits Name, Term, Group {

    // reference to another production
    record Name(String name) implements Primary {

        public Name {
            requireNonNull(name);
        }
    }

    // quoted string, character class or character code, kept as written
    record Term(String text) implements Primary {

        public Term {
            requireNonNull(text);
        }
    }

    // parenthesized choice
    record Group(Choice choice) implements Primary {

        public Group {
            requireNonNull(choice);
        }
    }
}
