package com.rewardradar.client;

/**
 * GraphQL documents sent to the app API. Only the fields the service reads are selected.
 */
final class GraphQlQueries {

    static final String HOMES = """
            {
              me {
                homes {
                  id
                  timeZone
                  hasSmartMeterCapabilities
                  hasSignedEnergyDeal
                  hasConsumption
                }
              }
            }
            """;

    static final String DEVICES = """
            query GetGizmos($homeId: String!) {
              me {
                home(id: $homeId) {
                  gizmos {
                    __typename
                    ... on Gizmo {
                      id
                      title
                      type
                      isHidden
                    }
                  }
                }
              }
            }
            """;

    // The API ignores daily resolution; monthly still honours the requested range.
    static final String GRID_REWARDS = """
            query GetGridRewards($homeId: String!, $fromDate: String!, $toDate: String!) {
              me {
                home(id: $homeId) {
                  gridRewardsHistoryPeriod(
                    from: $fromDate,
                    to: $toDate,
                    resolution: monthly
                  ) {
                    from
                    to
                    batteryRewards
                    vehicleRewards
                    totalReward
                    currency
                  }
                }
              }
            }
            """;

    private GraphQlQueries() {
    }
}
