package nl.nfi.djlcfrs.grammar;

// a single symbol in a predicate argument, e.g. in VP(X_0,X_1Y_3):
//      X_0, X_1 are variables and Y_3 is the terminal position 3
public interface Token {

    String render();

    record Position(int position) implements Token {

        @Override
        public String render() {
            return "Y_" + position;
        }
    }

    record Variable(int index) implements Token {

        @Override
        public String render() {
            return "X_" + index;
        }
    }

    // the literal word of a terminal rule
    record Terminal(String word) implements Token {

        @Override
        public String render() {
            return word;
        }
    }
}
