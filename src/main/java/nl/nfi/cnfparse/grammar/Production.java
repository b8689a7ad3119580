package nl.nfi.cnfparse.grammar;

// a weighted right-hand side as given by the user, e.g.:
//      S -> AB [0.6]
//  where symbols = "AB", probability = 0.6
public record Production(String symbols, double probability) {

    public static Production of(final String symbols, final double probability) {
        return new Production(symbols, probability);
    }
}
