package org.dicepool.dto.dice;

// Valeurs déjà tirées par l'oracle externe ; le moteur ne génère aucun aléa
public class ProcessRoundRequest {
    public int dice1;
    public int dice2;
    public int dice3;

    public ProcessRoundRequest() {}
    public ProcessRoundRequest(int dice1, int dice2, int dice3) {
        this.dice1 = dice1;
        this.dice2 = dice2;
        this.dice3 = dice3;
    }
}
